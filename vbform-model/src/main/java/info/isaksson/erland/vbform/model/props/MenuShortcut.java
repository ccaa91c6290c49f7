package info.isaksson.erland.vbform.model.props;

/** Keyboard accelerator of a menu item ({@code Shortcut} property). */
public enum MenuShortcut implements TextCodedEnum {
    CTRL_A("^A"),
    CTRL_B("^B"),
    CTRL_C("^C"),
    CTRL_D("^D"),
    CTRL_E("^E"),
    CTRL_F("^F"),
    CTRL_G("^G"),
    CTRL_H("^H"),
    CTRL_I("^I"),
    CTRL_J("^J"),
    CTRL_K("^K"),
    CTRL_L("^L"),
    CTRL_M("^M"),
    CTRL_N("^N"),
    CTRL_O("^O"),
    CTRL_P("^P"),
    CTRL_Q("^Q"),
    CTRL_R("^R"),
    CTRL_S("^S"),
    CTRL_T("^T"),
    CTRL_U("^U"),
    CTRL_V("^V"),
    CTRL_W("^W"),
    CTRL_X("^X"),
    CTRL_Y("^Y"),
    CTRL_Z("^Z"),
    F1("{F1}"),
    F2("{F2}"),
    F3("{F3}"),
    F4("{F4}"),
    F5("{F5}"),
    F6("{F6}"),
    F7("{F7}"),
    F8("{F8}"),
    F9("{F9}"),
    F11("{F11}"),
    F12("{F12}"),
    CTRL_F1("^{F1}"),
    CTRL_F2("^{F2}"),
    CTRL_F3("^{F3}"),
    CTRL_F4("^{F4}"),
    CTRL_F5("^{F5}"),
    CTRL_F6("^{F6}"),
    CTRL_F7("^{F7}"),
    CTRL_F8("^{F8}"),
    CTRL_F9("^{F9}"),
    CTRL_F11("^{F11}"),
    CTRL_F12("^{F12}"),
    SHIFT_F1("+{F1}"),
    SHIFT_F2("+{F2}"),
    SHIFT_F3("+{F3}"),
    SHIFT_F4("+{F4}"),
    SHIFT_F5("+{F5}"),
    SHIFT_F6("+{F6}"),
    SHIFT_F7("+{F7}"),
    SHIFT_F8("+{F8}"),
    SHIFT_F9("+{F9}"),
    SHIFT_F11("+{F11}"),
    SHIFT_F12("+{F12}"),
    SHIFT_CTRL_F1("+^{F1}"),
    SHIFT_CTRL_F2("+^{F2}"),
    SHIFT_CTRL_F3("+^{F3}"),
    SHIFT_CTRL_F4("+^{F4}"),
    SHIFT_CTRL_F5("+^{F5}"),
    SHIFT_CTRL_F6("+^{F6}"),
    SHIFT_CTRL_F7("+^{F7}"),
    SHIFT_CTRL_F8("+^{F8}"),
    SHIFT_CTRL_F9("+^{F9}"),
    SHIFT_CTRL_F11("+^{F11}"),
    SHIFT_CTRL_F12("+^{F12}"),
    CTRL_INSERT("^{INSERT}"),
    SHIFT_INSERT("+{INSERT}"),
    DELETE("{DEL}"),
    SHIFT_DELETE("+{DEL}"),
    ALT_BACKSPACE("%{BKSP}");

    private final String text;

    MenuShortcut(String text) {
        this.text = text;
    }

    @Override public String text() {
        return text;
    }
}
